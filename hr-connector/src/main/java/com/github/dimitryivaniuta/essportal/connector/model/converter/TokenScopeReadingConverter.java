package com.github.dimitryivaniuta.essportal.connector.model.converter;

import com.github.dimitryivaniuta.essportal.connector.token.TokenScope;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;

@ReadingConverter
public class TokenScopeReadingConverter implements Converter<String, TokenScope> {
    @Override
    public TokenScope convert(final String source) {
        return TokenScope.parse(source);
    }
}
