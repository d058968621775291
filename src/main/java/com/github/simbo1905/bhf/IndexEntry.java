package com.github.simbo1905.bhf;

/// One decoded entry of the index: the label shown to the user and the context it opens.
public record IndexEntry(String label, int contextId) {}
