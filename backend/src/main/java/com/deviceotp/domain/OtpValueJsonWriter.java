package com.deviceotp.domain;

import com.fasterxml.jackson.core.JsonGenerator;
import jakarta.annotation.Nullable;
import java.io.IOException;
import ru.tinkoff.kora.common.Component;
import ru.tinkoff.kora.json.common.JsonWriter;

@Component
public final class OtpValueJsonWriter implements JsonWriter<OtpValue> {

    @Override
    public void write(JsonGenerator gen, @Nullable OtpValue value) throws IOException {
        if (value == null) {
            gen.writeNull();
        } else {
            gen.writeString(value.text());
        }
    }
}
