package com.codeheadsystems.vionex.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TwoFactorVerifyResponse(@JsonProperty("valid") boolean valid) {
}
