package com.hookvisor.api.model;

public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR
}
