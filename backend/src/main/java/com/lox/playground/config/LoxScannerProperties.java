package com.lox.playground.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Positive;

@ConfigurationProperties(prefix = "lox.scanner")
@Validated
public record LoxScannerProperties(

    @Positive
    @DefaultValue("10000")
    int maxSourceLength,

    @DefaultValue("true")
    boolean appendTerminator,

    @DefaultValue("false")
    boolean logTokenMapping
) {

    public static LoxScannerProperties defaults() {
        return new LoxScannerProperties(10_000, true, false);
    }
}
