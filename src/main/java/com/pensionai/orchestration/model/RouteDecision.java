package com.pensionai.orchestration.model;

public record RouteDecision(String next, String reason) {
}
