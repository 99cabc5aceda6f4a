package com.github.anirbanmu.discorder.util;

import com.dslplatform.json.DslJson;
import com.dslplatform.json.runtime.Settings;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

public final class Json {
    public static final DslJson<Object> DSL = new DslJson<>(Settings.withRuntime().includeServiceLoader());

    private Json() {
    }

    public static String write(Object value) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        DSL.serialize(value, out);
        return out.toString(StandardCharsets.UTF_8);
    }
}
