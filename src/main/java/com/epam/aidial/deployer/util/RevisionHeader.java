package com.epam.aidial.deployer.util;

import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpServerRequest;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nullable;

/**
 * Optimistic revision check of an artifact write, taken from {@code If-Match} and {@code If-None-Match}.
 * The entity tag of an artifact is its revision number.
 */
@AllArgsConstructor
public class RevisionHeader {
    public static final String ANY_TAG = "*";
    public static final RevisionHeader ANY = new RevisionHeader(null, true);
    public static final RevisionHeader NEW_ONLY = new RevisionHeader(null, false);

    @Nullable
    private final Long revision;
    @Getter
    private final boolean overwrite;

    /**
     * @return the revision the write expects to replace: {@code null} when any head is accepted,
     * {@code 0} when the file must not exist yet.
     */
    @Nullable
    public Long expectedRevision() {
        if (!overwrite) {
            return 0L;
        }
        return revision;
    }

    public static RevisionHeader fromRequest(HttpServerRequest request) {
        return fromHeader(request.getHeader(HttpHeaders.IF_MATCH), request.getHeader(HttpHeaders.IF_NONE_MATCH));
    }

    public static String toEtag(long revision) {
        return "\"" + revision + "\"";
    }

    static RevisionHeader fromHeader(String ifMatch, String ifNoneMatch) {
        boolean overwrite = parseOverwrite(StringUtils.strip(ifNoneMatch));
        Long revision = parseIfMatch(StringUtils.strip(ifMatch));
        if (!overwrite && revision != null) {
            throw new HttpException(HttpStatus.BAD_REQUEST, "If-Match and If-None-Match can't be combined");
        }
        return new RevisionHeader(revision, overwrite);
    }

    @Nullable
    private static Long parseIfMatch(String value) {
        if (StringUtils.isEmpty(value) || ANY_TAG.equals(value)) {
            return null;
        }

        if (value.contains(",")) {
            throw new HttpException(HttpStatus.BAD_REQUEST, "Only a single revision is supported for header " + HttpHeaders.IF_MATCH);
        }

        String tag = StringUtils.strip(StringUtils.removeStart(value, "W/"), "\"");
        try {
            return Long.parseLong(tag);
        } catch (NumberFormatException e) {
            throw new HttpException(HttpStatus.BAD_REQUEST, "Invalid revision in header %s: %s".formatted(HttpHeaders.IF_MATCH, value));
        }
    }

    private static boolean parseOverwrite(String value) {
        if (ANY_TAG.equals(value)) {
            return false;
        }

        if (value != null) {
            throw new HttpException(
                    HttpStatus.BAD_REQUEST, "Only * is supported for header " + HttpHeaders.IF_NONE_MATCH);
        }

        return true;
    }
}
