package io.b2mash.b2b.reportengine.report.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FavoriteResponse(@JsonProperty("isFavorite") boolean favorite) {}
