package com.storefront.catalog.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * One entry of a per-letter catalog file ({@code _.json}, {@code a.json} … {@code z.json}).
 * Optional fields are left out of the JSON when absent; {@code platforms} is always written.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "type", "price", "image", "href", "uuid", "platforms", "rating"})
public record OutputItem(String name,
                         @JsonProperty("type") String kind,
                         String price,
                         String image,
                         String href,
                         String uuid,
                         @JsonInclude(JsonInclude.Include.ALWAYS) List<String> platforms,
                         Rating rating) {
}
