package com.gnovoa.fantasy.model;

public record Team(String teamId, String name) {}
