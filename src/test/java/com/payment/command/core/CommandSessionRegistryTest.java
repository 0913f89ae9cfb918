package com.payment.command.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandSessionRegistryTest {

    @Test
    void findsRegisteredSession() {
        CommandSessionRegistry registry = new CommandSessionRegistry(10);
        CommandInvoker invoker = new CommandInvoker();

        registry.register("pay-1", invoker);

        assertThat(registry.find("pay-1")).containsSame(invoker);
        assertThat(registry.find("pay-2")).isEmpty();
    }

    @Test
    void evictsLeastRecentlyUsedWhenFull() {
        CommandSessionRegistry registry = new CommandSessionRegistry(2);
        registry.register("pay-1", new CommandInvoker());
        registry.register("pay-2", new CommandInvoker());
        registry.find("pay-1");

        registry.register("pay-3", new CommandInvoker());

        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.find("pay-1")).isPresent();
        assertThat(registry.find("pay-2")).isEmpty();
        assertThat(registry.find("pay-3")).isPresent();
    }

    @Test
    void removeDropsSession() {
        CommandSessionRegistry registry = new CommandSessionRegistry(10);
        registry.register("pay-1", new CommandInvoker());

        registry.remove("pay-1");

        assertThat(registry.find("pay-1")).isEmpty();
    }

    @Test
    void capacityMustBePositive() {
        assertThatThrownBy(() -> new CommandSessionRegistry(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
