package com.deviceotp.domain;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import jakarta.annotation.Nullable;
import java.io.IOException;
import ru.tinkoff.kora.common.Component;
import ru.tinkoff.kora.json.common.JsonReader;

@Component
public final class OtpValueJsonReader implements JsonReader<OtpValue> {

    @Nullable
    @Override
    public OtpValue read(JsonParser parser) throws IOException {
        JsonToken token = parser.currentToken();
        if (token == JsonToken.VALUE_NULL) {
            return null;
        }
        if (token == JsonToken.VALUE_STRING || token == JsonToken.VALUE_NUMBER_INT) {
            return new OtpValue(parser.getText());
        }
        throw new JsonParseException(parser, "otp must be a string or an integer, got " + token);
    }
}
