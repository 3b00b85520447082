package org.carball.tiercheck.model.scenario;

public record Relationship(String from, String to, String type) {
}
