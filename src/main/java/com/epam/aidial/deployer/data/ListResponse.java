package com.epam.aidial.deployer.data;

import java.util.List;

public record ListResponse<T>(List<T> items, int total) {
}
