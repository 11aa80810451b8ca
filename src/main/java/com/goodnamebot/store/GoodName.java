/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.goodnamebot.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * One curated good name record as stored in the backing document.
 *
 * <p>The name is the natural key of the store. Everything but the votes is
 * fixed at creation.
 */
@JsonPropertyOrder({"good_name", "added_by", "date_added", "season", "votes"})
public class GoodName {

    public static final String DATE_PATTERN = "yyyy-MM-dd HH:mm:ss";

    @JsonProperty("good_name")
    private final String goodName;

    @JsonProperty("added_by")
    private final String addedBy;

    @JsonProperty("date_added")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = DATE_PATTERN)
    private final LocalDateTime dateAdded;

    @JsonProperty("season")
    private final String season;

    @JsonProperty("votes")
    private final Map<String, Object> votes;

    @JsonCreator
    public GoodName(@JsonProperty(value = "good_name", required = true) String goodName,
                    @JsonProperty("added_by") String addedBy,
                    @JsonProperty("date_added") LocalDateTime dateAdded,
                    @JsonProperty("season") String season,
                    @JsonProperty("votes") Map<String, Object> votes) {
        if (goodName == null || goodName.isBlank()) {
            throw new IllegalArgumentException("good_name cannot be null or blank");
        }
        this.goodName = goodName;
        this.addedBy = addedBy;
        this.dateAdded = dateAdded;
        this.season = season;
        this.votes = votes != null ? new LinkedHashMap<>(votes) : new LinkedHashMap<>();
    }

    /**
     * Creates a fresh record with no votes.
     */
    public static GoodName create(String goodName, String addedBy, String season, LocalDateTime dateAdded) {
        return new GoodName(goodName, addedBy, dateAdded, season, null);
    }

    /**
     * Normalizes a proposed good name: surrounding whitespace (Unicode included) is stripped, the
     * first character is title-cased and the rest lower-cased.
     * {@code "  diana PRINCE "} becomes {@code "Diana prince"}.
     *
     * @param raw proposed text, may be null
     * @return normalized text, empty when the input is null or blank
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String trimmed = raw.strip();
        if (trimmed.isEmpty()) {
            return "";
        }
        int first = trimmed.codePointAt(0);
        int restStart = Character.charCount(first);
        return new StringBuilder()
                .appendCodePoint(Character.toTitleCase(first))
                .append(trimmed.substring(restStart).toLowerCase(Locale.ROOT))
                .toString();
    }

    public String getGoodName() {
        return goodName;
    }

    public String getAddedBy() {
        return addedBy;
    }

    public LocalDateTime getDateAdded() {
        return dateAdded;
    }

    public String getSeason() {
        return season;
    }

    /** Mutable vote tally, voter id to an arbitrary JSON vote value. */
    public Map<String, Object> getVotes() {
        return votes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GoodName)) return false;
        GoodName that = (GoodName) o;
        return goodName.equals(that.goodName)
                && Objects.equals(addedBy, that.addedBy)
                && Objects.equals(dateAdded, that.dateAdded)
                && Objects.equals(season, that.season)
                && votes.equals(that.votes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(goodName, addedBy, dateAdded, season, votes);
    }

    @Override
    public String toString() {
        return "GoodName{" + goodName + ", addedBy=" + addedBy + ", season=" + season + "}";
    }
}
