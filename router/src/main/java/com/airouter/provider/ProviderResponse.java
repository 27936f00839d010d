package com.airouter.provider;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ProviderResponse {
    String content;
    String model;
    Integer tokensUsed;
}
