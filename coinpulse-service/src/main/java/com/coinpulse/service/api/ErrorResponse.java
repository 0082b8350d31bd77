package com.coinpulse.service.api;

public record ErrorResponse(String error) {}
