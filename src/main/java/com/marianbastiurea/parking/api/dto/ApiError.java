package com.marianbastiurea.parking.api.dto;

import java.time.Instant;

public record ApiError(int status, String error, String message, Instant timestamp) {}
