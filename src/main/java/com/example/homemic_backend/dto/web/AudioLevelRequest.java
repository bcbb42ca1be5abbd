package com.example.homemic_backend.dto.web;

public record AudioLevelRequest(double level, double peak) {}
