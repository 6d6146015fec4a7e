package com.autoinsight.mapper.config;

import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;

@Configuration
public class OpenApiConfig {

  @Value("${springdoc.info.title:Auto-Insight Column Mapper API}")
  private String title;

  @Value("${springdoc.info.version:0.1.0}")
  private String version;

  @Value(
      "${springdoc.info.description:Maps the columns of uploaded e-commerce, review and sales"
          + " tables onto standard analysis schemas using column-name similarity and data"
          + " profiling.}")
  private String description;

  @Value("${server.port:8081}")
  private String serverPort;

  @Bean
  public OpenAPI customOpenAPI() {
    return new OpenAPI()
        .info(new Info().title(title).version(version).description(description))
        .servers(
            List.of(
                new Server()
                    .url("http://localhost:" + serverPort)
                    .description("Local development server")));
  }
}
