package com.example.slidecast_backend.engine.Interfaces;

/**
 * Common base of all external providers. The name shows up in logs and provider-chain errors.
 */
public interface NamedProvider {
    String name();
}
