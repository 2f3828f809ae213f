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

import com.google.common.base.MoreObjects;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;

/**
 * The meta information that a gateway reports along with an uplink packet.
 * <p>
 * Instances are immutable views on the JSON object reported by the gateway.
 * Metadata that has been decoded from its serialized form retains the original
 * bytes and is serialized to exactly these bytes again, so that meta information
 * passes through the broker without loss. The typed getters interpret well known
 * properties and return {@code null} if a property is missing or has an unexpected type.
 */
public final class Metadata {

    static final String FIELD_TIME = "time";
    static final String FIELD_TIMESTAMP = "tmst";
    static final String FIELD_CHANNEL = "chan";
    static final String FIELD_RF_CHAIN = "rfch";
    static final String FIELD_CRC_STATUS = "stat";
    static final String FIELD_FREQUENCY = "freq";
    static final String FIELD_MODULATION = "modu";
    static final String FIELD_DATA_RATE = "datr";
    static final String FIELD_CODING_RATE = "codr";
    static final String FIELD_RSSI = "rssi";
    static final String FIELD_SNR = "lsnr";
    static final String FIELD_PAYLOAD_SIZE = "size";
    static final String FIELD_GATEWAY_ID = "gwid";
    static final String FIELD_LOCATION = "location";

    private final JsonObject json;
    // the bytes this instance has been decoded from, null if created from properties
    private final Buffer serialized;

    /**
     * Creates empty metadata.
     */
    public Metadata() {
        this(new JsonObject(), null);
    }

    private Metadata(final JsonObject json, final Buffer serialized) {
        this.json = json;
        this.serialized = serialized;
    }

    /**
     * Creates metadata from a JSON object.
     *
     * @param json The JSON object. The object is copied.
     * @return The metadata.
     * @throws NullPointerException if json is {@code null}.
     */
    public static Metadata fromJson(final JsonObject json) {
        Objects.requireNonNull(json);
        return new Metadata(json.copy(), null);
    }

    /**
     * Creates metadata from its serialized form.
     * <p>
     * An empty buffer represents empty metadata.
     *
     * @param buffer The UTF-8 encoded JSON object.
     * @return The metadata. Its serialized form consists of the same bytes as the given buffer.
     * @throws NullPointerException if buffer is {@code null}.
     * @throws DecodeException if the buffer does not contain a JSON object.
     */
    public static Metadata fromBuffer(final Buffer buffer) {
        Objects.requireNonNull(buffer);
        if (buffer.length() == 0) {
            return new Metadata(new JsonObject(), Buffer.buffer());
        }
        return new Metadata(new JsonObject(buffer), buffer.copy());
    }

    /**
     * Gets the serialized form of this metadata.
     *
     * @return The UTF-8 encoded JSON object. For metadata that has been created by means of
     *         {@link #fromBuffer(Buffer)} these are the original bytes.
     */
    public Buffer toBuffer() {
        return serialized == null ? json.toBuffer() : serialized.copy();
    }

    /**
     * Gets all properties of this metadata.
     *
     * @return A copy of the JSON object.
     */
    public JsonObject toJson() {
        return json.copy();
    }

    private Metadata with(final String name, final Object value) {
        final JsonObject result = json.copy();
        if (value == null) {
            result.remove(name);
        } else {
            result.put(name, value);
        }
        return new Metadata(result, null);
    }

    static String getString(final JsonObject obj, final String name) {
        final Object value = obj.getValue(name);
        return value instanceof String ? (String) value : null;
    }

    static Integer getInteger(final JsonObject obj, final String name) {
        final Object value = obj.getValue(name);
        return value instanceof Number ? ((Number) value).intValue() : null;
    }

    static Long getLong(final JsonObject obj, final String name) {
        final Object value = obj.getValue(name);
        return value instanceof Number ? ((Number) value).longValue() : null;
    }

    static Double getDouble(final JsonObject obj, final String name) {
        final Object value = obj.getValue(name);
        return value instanceof Number ? ((Number) value).doubleValue() : null;
    }

    /**
     * Gets the UTC time at which the gateway received the packet.
     *
     * @return The time in RFC 3339 format or {@code null} if unknown.
     */
    public String getTime() {
        return getString(json, FIELD_TIME);
    }

    /**
     * Sets the UTC time at which the gateway received the packet.
     *
     * @param time The time in RFC 3339 format or {@code null} if unknown.
     * @return A copy of this metadata with the time set.
     */
    public Metadata withTime(final String time) {
        return with(FIELD_TIME, time);
    }

    /**
     * Gets the value of the gateway's internal counter when the packet was received.
     *
     * @return The counter value in microseconds or {@code null} if unknown.
     */
    public Long getTimestamp() {
        return getLong(json, FIELD_TIMESTAMP);
    }

    /**
     * Sets the value of the gateway's internal counter when the packet was received.
     *
     * @param timestamp The counter value in microseconds or {@code null} if unknown.
     * @return A copy of this metadata with the timestamp set.
     */
    public Metadata withTimestamp(final Long timestamp) {
        return with(FIELD_TIMESTAMP, timestamp);
    }

    /**
     * Gets the concentrator IF channel that the packet has been received on.
     *
     * @return The channel or {@code null} if unknown.
     */
    public Integer getChannel() {
        return getInteger(json, FIELD_CHANNEL);
    }

    /**
     * Sets the concentrator IF channel that the packet has been received on.
     *
     * @param channel The channel or {@code null} if unknown.
     * @return A copy of this metadata with the channel set.
     */
    public Metadata withChannel(final Integer channel) {
        return with(FIELD_CHANNEL, channel);
    }

    /**
     * @return The concentrator RF chain or {@code null} if unknown.
     */
    public Integer getRfChain() {
        return getInteger(json, FIELD_RF_CHAIN);
    }

    /**
     * @param rfChain The concentrator RF chain or {@code null} if unknown.
     * @return A copy of this metadata with the RF chain set.
     */
    public Metadata withRfChain(final Integer rfChain) {
        return with(FIELD_RF_CHAIN, rfChain);
    }

    /**
     * Gets the result of the gateway's CRC check.
     *
     * @return 1 if the CRC is OK, -1 if it failed, 0 if there was none
     *         or {@code null} if unknown.
     */
    public Integer getCrcStatus() {
        return getInteger(json, FIELD_CRC_STATUS);
    }

    /**
     * Sets the result of the gateway's CRC check.
     *
     * @param crcStatus 1 if the CRC is OK, -1 if it failed, 0 if there was none
     *         or {@code null} if unknown.
     * @return A copy of this metadata with the CRC status set.
     */
    public Metadata withCrcStatus(final Integer crcStatus) {
        return with(FIELD_CRC_STATUS, crcStatus);
    }

    /**
     * Gets the frequency that the packet has been received on.
     *
     * @return The frequency in MHz or {@code null} if unknown.
     */
    public Double getFrequency() {
        return getDouble(json, FIELD_FREQUENCY);
    }

    /**
     * Sets the frequency that the packet has been received on.
     *
     * @param frequency The frequency in MHz or {@code null} if unknown.
     * @return A copy of this metadata with the frequency set.
     * @throws IllegalArgumentException if frequency is negative.
     */
    public Metadata withFrequency(final Double frequency) {
        if (frequency != null && frequency < 0) {
            throw new IllegalArgumentException("frequency must not be negative");
        }
        return with(FIELD_FREQUENCY, frequency);
    }

    /**
     * @return The modulation, e.g. {@code LORA}, or {@code null} if unknown.
     */
    public String getModulation() {
        return getString(json, FIELD_MODULATION);
    }

    /**
     * @param modulation The modulation, e.g. {@code LORA}, or {@code null} if unknown.
     * @return A copy of this metadata with the modulation set.
     */
    public Metadata withModulation(final String modulation) {
        return with(FIELD_MODULATION, modulation);
    }

    /**
     * @return The data rate identifier, e.g. {@code SF7BW125}, or {@code null} if unknown.
     */
    public String getDataRate() {
        return getString(json, FIELD_DATA_RATE);
    }

    /**
     * @param dataRate The data rate identifier, e.g. {@code SF7BW125}, or {@code null} if unknown.
     * @return A copy of this metadata with the data rate set.
     */
    public Metadata withDataRate(final String dataRate) {
        return with(FIELD_DATA_RATE, dataRate);
    }

    /**
     * @return The coding rate, e.g. {@code 4/5}, or {@code null} if unknown.
     */
    public String getCodingRate() {
        return getString(json, FIELD_CODING_RATE);
    }

    /**
     * @param codingRate The coding rate, e.g. {@code 4/5}, or {@code null} if unknown.
     * @return A copy of this metadata with the coding rate set.
     */
    public Metadata withCodingRate(final String codingRate) {
        return with(FIELD_CODING_RATE, codingRate);
    }

    /**
     * Gets the received signal strength indicator.
     * <p>
     * Fractional values reported by a gateway are truncated by this getter
     * but retained in the JSON object.
     *
     * @return The RSSI in dBm or {@code null} if unknown.
     */
    public Integer getRssi() {
        return getInteger(json, FIELD_RSSI);
    }

    /**
     * Sets the received signal strength indicator.
     *
     * @param rssi The RSSI in dBm or {@code null} if unknown.
     * @return A copy of this metadata with the RSSI set.
     */
    public Metadata withRssi(final Integer rssi) {
        return with(FIELD_RSSI, rssi);
    }

    /**
     * Gets the signal to noise ratio.
     *
     * @return The LoRa SNR in dB or {@code null} if unknown.
     */
    public Double getSnr() {
        return getDouble(json, FIELD_SNR);
    }

    /**
     * Sets the signal to noise ratio.
     *
     * @param snr The LoRa SNR in dB or {@code null} if unknown.
     * @return A copy of this metadata with the SNR set.
     */
    public Metadata withSnr(final Double snr) {
        return with(FIELD_SNR, snr);
    }

    /**
     * @return The size of the radio payload in bytes or {@code null} if unknown.
     */
    public Integer getPayloadSize() {
        return getInteger(json, FIELD_PAYLOAD_SIZE);
    }

    /**
     * @param payloadSize The size of the radio payload in bytes or {@code null} if unknown.
     * @return A copy of this metadata with the payload size set.
     */
    public Metadata withPayloadSize(final Integer payloadSize) {
        return with(FIELD_PAYLOAD_SIZE, payloadSize);
    }

    /**
     * @return The identifier of the receiving gateway or {@code null} if unknown.
     */
    public String getGatewayId() {
        return getString(json, FIELD_GATEWAY_ID);
    }

    /**
     * @param gatewayId The identifier of the receiving gateway or {@code null} if unknown.
     * @return A copy of this metadata with the gateway identifier set.
     */
    public Metadata withGatewayId(final String gatewayId) {
        return with(FIELD_GATEWAY_ID, gatewayId);
    }

    /**
     * @return The location of the receiving gateway or {@code null} if unknown.
     */
    public Location getLocation() {
        final Object value = json.getValue(FIELD_LOCATION);
        return value instanceof JsonObject ? Location.fromJson((JsonObject) value) : null;
    }

    /**
     * @param location The location of the receiving gateway or {@code null} if unknown.
     * @return A copy of this metadata with the location set.
     */
    public Metadata withLocation(final Location location) {
        return with(FIELD_LOCATION, location == null ? null : location.toJson());
    }

    /**
     * Sets a property that has no dedicated accessor.
     *
     * @param name The property name.
     * @param value The property value or {@code null} to remove the property.
     * @return A copy of this metadata with the property set.
     * @throws NullPointerException if name is {@code null}.
     * @throws IllegalStateException if the value cannot be represented in JSON.
     */
    public Metadata withProperty(final String name, final Object value) {
        Objects.requireNonNull(name);
        return with(name, value);
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Metadata)) {
            return false;
        }
        return json.equals(((Metadata) obj).json);
    }

    @Override
    public int hashCode() {
        return json.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .omitNullValues()
                .add("gatewayId", getGatewayId())
                .add("time", getTime())
                .add("frequency", getFrequency())
                .add("dataRate", getDataRate())
                .add("rssi", json.getValue(FIELD_RSSI))
                .add("snr", json.getValue(FIELD_SNR))
                .toString();
    }
}
