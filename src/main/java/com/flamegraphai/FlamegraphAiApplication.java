package com.flamegraphai;

import com.flamegraphai.config.FlamegraphProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

/**
 * Flamegraph AI - speedscope profile hotspot analyzer
 */
@SpringBootApplication
public class FlamegraphAiApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlamegraphAiApplication.class, args);
    }

    @Bean
    public CorsFilter corsFilter(FlamegraphProperties properties) {
        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        CorsConfiguration config = new CorsConfiguration();
        config.addAllowedOriginPattern(properties.getCorsOrigin());
        config.addAllowedHeader("*");
        config.addAllowedMethod("*");
        source.registerCorsConfiguration("/**", config);
        return new CorsFilter(source);
    }
}
