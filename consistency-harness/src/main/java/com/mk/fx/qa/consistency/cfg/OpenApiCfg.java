package com.mk.fx.qa.consistency.cfg;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiCfg {

  @Bean
  public OpenAPI openApi() {
    return new OpenAPI()
        .info(
            new Info()
                .title("Consistency Harness API")
                .description(
                    "Runs backpressure, idempotency, latency and eventual-consistency scenarios"
                        + " against a system under test."));
  }
}
