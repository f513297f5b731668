package com.chipsim.hdlgen.parser;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JSON shape of a Digital Logic Sim chip file. Used only for loading; the
 * simulator writes many more properties (colours, positions) that are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChipDocument(
        @JsonProperty("Name") String name,
        @JsonProperty("InputPins") List<PinDocument> inputPins,
        @JsonProperty("OutputPins") List<PinDocument> outputPins,
        @JsonProperty("SubChips") List<SubChipDocument> subChips,
        @JsonProperty("Wires") List<WireDocument> wires
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PinDocument(
            @JsonProperty("Name") String name,
            @JsonProperty("ID") Integer id,
            @JsonProperty("BitCount") Integer bitCount
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SubChipDocument(
            @JsonProperty("Name") String name,
            @JsonProperty("ID") Integer id,
            @JsonProperty("Label") String label,
            @JsonProperty("OutputPinColourInfo") List<OutputPinInfo> outputPinColourInfo
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputPinInfo(
            @JsonProperty("PinID") Integer pinId
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WireDocument(
            @JsonProperty("SourcePinAddress") PinAddressDocument source,
            @JsonProperty("TargetPinAddress") PinAddressDocument target
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PinAddressDocument(
            @JsonProperty("PinOwnerID") Integer ownerId,
            @JsonProperty("PinID") Integer pinId
    ) {}

    // Missing arrays read as empty

    public List<PinDocument> inputPins() {
        return inputPins != null ? inputPins : List.of();
    }

    public List<PinDocument> outputPins() {
        return outputPins != null ? outputPins : List.of();
    }

    public List<SubChipDocument> subChips() {
        return subChips != null ? subChips : List.of();
    }

    public List<WireDocument> wires() {
        return wires != null ? wires : List.of();
    }
}
