package com.vulnwitness.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A frame of a call stack. {@code call} induces the next frame and is
 * null for the last frame.
 */
@Getter
@AllArgsConstructor
public class StackEntry {
    private final FuncNode function;
    private final CallSite call;

    @Override
    public String toString() {
        return function.toString();
    }
}
