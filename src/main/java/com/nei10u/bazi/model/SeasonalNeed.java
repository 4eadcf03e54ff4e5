package com.nei10u.bazi.model;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * 调候需求。平季不急，neededElement 为空，喜用以强弱结论为准。
 */
@Value
@Builder
public class SeasonalNeed {

    Season season;
    boolean urgent;
    Element neededElement;
    String status;
    String needs;
    String advice;

    public Optional<Element> needed() {
        return Optional.ofNullable(neededElement);
    }
}
