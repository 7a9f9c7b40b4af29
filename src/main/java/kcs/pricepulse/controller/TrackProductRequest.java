package kcs.pricepulse.controller;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record TrackProductRequest(
        @NotBlank @Size(max = 700)
        String url
) {
}
