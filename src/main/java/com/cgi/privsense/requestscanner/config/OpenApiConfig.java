package com.cgi.privsense.requestscanner.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("PrivSense Request Scanner API")
                        .version("1.0")
                        .description("API para detecção de dados pessoais e classificação de pedidos de acesso à informação")
                        .contact(new Contact().name("CGI").url("https://www.cgi.com")))
                .addTagsItem(new Tag().name("Request Scanner").description("API para classificação de pedidos como públicos ou não públicos"));
    }
}
