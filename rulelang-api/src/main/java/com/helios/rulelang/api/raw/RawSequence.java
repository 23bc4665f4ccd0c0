/*
 * Copyright (c) 2025 Helios Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.rulelang.api.raw;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered list of raw values.
 */
public record RawSequence(List<RawValue> elements) implements RawValue {

    public RawSequence {
        elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    public int size() {
        return elements.size();
    }

    public RawValue get(int index) {
        return elements.get(index);
    }

    @Override
    public Object toPlainObject() {
        List<Object> plain = new ArrayList<>(elements.size());
        for (RawValue element : elements) {
            plain.add(element.toPlainObject());
        }
        return plain;
    }
}
