package com.epam.aidial.deployer.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class UrlUtilTest {

    @Test
    void testEncodePathSegment() {
        assertEquals("Dockerfile", UrlUtil.encodePathSegment("Dockerfile"));
        assertEquals("k8s%2Fdeployment.yaml", UrlUtil.encodePathSegment("k8s/deployment.yaml"));
        assertEquals("my%20file", UrlUtil.encodePathSegment("my file"));
    }

    @Test
    void testDecodePath() {
        assertEquals("k8s/deployment.yaml", UrlUtil.decodePath("k8s%2Fdeployment.yaml"));
        assertEquals("my file", UrlUtil.decodePath("my%20file"));
        assertEquals("docker-compose.yml", UrlUtil.decodePath("docker-compose.yml"));
    }
}
