package io.sunplane.client;

import java.util.List;

public record WhoAmI(String accountId, String accountSlug, String tokenId, List<String> scopes) {
}
