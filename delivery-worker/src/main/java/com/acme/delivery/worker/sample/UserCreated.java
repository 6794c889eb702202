package com.acme.delivery.worker.sample;

public record UserCreated(String id, String username, String email) {}
