package com.frontline.service;

/**
 * Expected business failures reported back to the acting player.
 */
public enum ErrorKind {
    NOT_FOUND,
    INVALID_STATE,
    INVALID_TARGET,
    FORBIDDEN,
    CONFLICT,
    COOLDOWN,
    INSUFFICIENT_RESOURCES
}
