package com.example.feedpipeline.storage;

public record StoredFile(String path, long size) {
}
