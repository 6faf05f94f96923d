package com.example.AlignAi.model;

public record NiceToHaveSkill(String name, double importance) {
}
