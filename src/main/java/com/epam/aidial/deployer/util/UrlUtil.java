package com.epam.aidial.deployer.util;

import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;
import lombok.SneakyThrows;
import lombok.experimental.UtilityClass;
import org.apache.commons.codec.net.PercentCodec;

import java.nio.charset.StandardCharsets;

@UtilityClass
public class UrlUtil {

    private static final PercentCodec DECODER = new PercentCodec();
    private static final Escaper ENCODER = UrlEscapers.urlPathSegmentEscaper();

    public String encodePathSegment(String segment) {
        return ENCODER.escape(segment);
    }

    @SneakyThrows
    public String decodePath(String path) {
        return new String(DECODER.decode(path.getBytes(StandardCharsets.UTF_8)), StandardCharsets.UTF_8);
    }
}
