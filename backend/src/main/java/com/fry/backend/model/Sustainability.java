package com.fry.backend.model;

public enum Sustainability {
    SUSTAINABLE,
    MANAGEABLE,
    CONCERNING,
    UNSUSTAINABLE
}
