package io.logtriage.model;

public record Cookbook(String title, String markdown, int sections) {
}
