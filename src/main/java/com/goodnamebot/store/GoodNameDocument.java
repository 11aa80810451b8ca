/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.goodnamebot.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of the backing JSON document: a single {@code good_names} list.
 */
public class GoodNameDocument {

    @JsonProperty("good_names")
    private final List<GoodName> goodNames;

    @JsonCreator
    public GoodNameDocument(@JsonProperty(value = "good_names", required = true) List<GoodName> goodNames) {
        if (goodNames == null) {
            throw new IllegalArgumentException("good_names list is missing");
        }
        this.goodNames = new ArrayList<>(goodNames);
    }

    public List<GoodName> getGoodNames() {
        return goodNames;
    }

    /**
     * Returns a copy of this document with one more record appended.
     */
    public GoodNameDocument withAppended(GoodName goodName) {
        List<GoodName> copy = new ArrayList<>(goodNames);
        copy.add(goodName);
        return new GoodNameDocument(copy);
    }
}
