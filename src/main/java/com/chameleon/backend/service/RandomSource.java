package com.chameleon.backend.service;

@FunctionalInterface
public interface RandomSource {
    int nextInt(int bound);
}
