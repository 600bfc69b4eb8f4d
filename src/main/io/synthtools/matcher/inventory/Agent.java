package io.synthtools.matcher.inventory;

import com.fasterxml.jackson.databind.JsonNode;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * A probe machine that runs synthetic test tasks.
 */
@Immutable
public final class Agent extends InventoryObject {

    public static final String ID = "id";
    public static final String NAME = "name";
    public static final String ALIAS = "alias";
    public static final String TYPE = "type";
    public static final String ASN = "asn";
    public static final String COUNTRY = "country";
    public static final String SITE_NAME = "site_name";

    public Agent(@Nonnull final JsonNode attributes) {
        super(attributes);
        if (id() == null) {
            throw new IllegalArgumentException("Agent without '" + ID + "' attribute: " + attributes);
        }
    }

    @Nonnull
    public String id() {
        return scalar(ID);
    }

    @Nullable
    public String name() {
        return scalar(NAME);
    }

    @Nullable
    public String alias() {
        return scalar(ALIAS);
    }

    @Nullable
    public String type() {
        return scalar(TYPE);
    }

    @Nullable
    public String asn() {
        return scalar(ASN);
    }

    @Nullable
    public String country() {
        return scalar(COUNTRY);
    }

    @Nullable
    public String siteName() {
        return scalar(SITE_NAME);
    }
}
