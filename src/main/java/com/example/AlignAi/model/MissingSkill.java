package com.example.AlignAi.model;

public record MissingSkill(String name, double importance) {
}
