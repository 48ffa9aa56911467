package com.marianbastiurea.parking.api.dto;

public record ClearResult(String target, int removed) {}
