/*******************************************************************************
 * Copyright (c) 2019, 2023 Contributors to the Eclipse Foundation
 *
 * See the NOTICE file(s) distributed with this work for additional
 * information regarding copyright ownership.
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Public License 2.0 which is available at
 * http://www.eclipse.org/legal/epl-2.0
 *
 * SPDX-License-Identifier: EPL-2.0
 *******************************************************************************/

package org.eclipse.lorabroker.packet;

import java.util.Objects;

import io.vertx.core.json.JsonObject;

/**
 * The geo-location of a receiving gateway.
 * <p>
 * Instances are immutable views on the JSON object reported by the gateway.
 * Properties other than the coordinates are retained.
 */
public final class Location {

    static final String FIELD_LATITUDE = "lati";
    static final String FIELD_LONGITUDE = "long";
    static final String FIELD_ALTITUDE = "alti";

    private final JsonObject json;

    /**
     * Creates a new location for coordinates.
     *
     * @param latitude The latitude in decimal degrees.
     * @param longitude The longitude in decimal degrees.
     * @param altitude The altitude in meters or {@code null} if unknown.
     * @throws NullPointerException if latitude or longitude are {@code null}.
     */
    public Location(final Double latitude, final Double longitude, final Integer altitude) {
        this(new JsonObject()
                .put(FIELD_LATITUDE, Objects.requireNonNull(latitude))
                .put(FIELD_LONGITUDE, Objects.requireNonNull(longitude)));
        if (altitude != null) {
            json.put(FIELD_ALTITUDE, altitude);
        }
    }

    private Location(final JsonObject json) {
        this.json = json;
    }

    /**
     * Creates a location from a JSON object.
     *
     * @param json The JSON object. The object is copied.
     * @return The location.
     * @throws NullPointerException if json is {@code null}.
     */
    public static Location fromJson(final JsonObject json) {
        Objects.requireNonNull(json);
        return new Location(json.copy());
    }

    /**
     * @return The latitude in decimal degrees or {@code null} if unknown.
     */
    public Double getLatitude() {
        return Metadata.getDouble(json, FIELD_LATITUDE);
    }

    /**
     * @return The longitude in decimal degrees or {@code null} if unknown.
     */
    public Double getLongitude() {
        return Metadata.getDouble(json, FIELD_LONGITUDE);
    }

    /**
     * @return The altitude in meters or {@code null} if unknown.
     */
    public Integer getAltitude() {
        return Metadata.getInteger(json, FIELD_ALTITUDE);
    }

    /**
     * Gets all properties of this location.
     *
     * @return A copy of the JSON object.
     */
    public JsonObject toJson() {
        return json.copy();
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Location)) {
            return false;
        }
        return json.equals(((Location) obj).json);
    }

    @Override
    public int hashCode() {
        return json.hashCode();
    }
}
