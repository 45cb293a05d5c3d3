package com.github.dimitryivaniuta.essportal.connector.config;

import com.github.dimitryivaniuta.essportal.connector.model.converter.TokenScopeReadingConverter;
import com.github.dimitryivaniuta.essportal.connector.model.converter.TokenScopeWritingConverter;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.CustomConversions;
import org.springframework.data.r2dbc.convert.R2dbcCustomConversions;
import org.springframework.data.r2dbc.dialect.PostgresDialect;

@Configuration
public class R2dbcConfig {

    @Bean
    public R2dbcCustomConversions r2dbcCustomConversions() {
        var dialect = PostgresDialect.INSTANCE;
        var storeConversions = CustomConversions.StoreConversions.of(dialect.getSimpleTypeHolder());

        // scope column <-> TokenScope
        List<Converter<?, ?>> converters = List.of(
                new TokenScopeReadingConverter(),
                new TokenScopeWritingConverter()
        );

        return new R2dbcCustomConversions(storeConversions, converters);
    }
}
