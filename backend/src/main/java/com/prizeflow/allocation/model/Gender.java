package com.prizeflow.allocation.model;

public enum Gender {
    M,
    F,
    OTHER
}
