package com.delta.autoapply.apply.model;

/**
 * Opaque handle a platform adapter uses to locate a detected field again on the live surface.
 */
public interface FieldReference {
    String describe();
}
