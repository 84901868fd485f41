package net.convertcompress.model.image;

public enum FlipAxis {
    HORIZONTAL,
    VERTICAL
}
