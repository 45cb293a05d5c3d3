package com.github.dimitryivaniuta.essportal.connector.model.converter;

import com.github.dimitryivaniuta.essportal.connector.token.TokenScope;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.WritingConverter;

@WritingConverter
public class TokenScopeWritingConverter implements Converter<TokenScope, String> {
    @Override
    public String convert(final TokenScope source) {
        return source.toColumnValue();
    }
}
