package com.chipsim.hdlgen.parser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chipsim.hdlgen.model.ChipGraph;
import com.chipsim.hdlgen.model.ComponentInstance;
import com.chipsim.hdlgen.model.PinAddress;
import com.chipsim.hdlgen.model.TopLevelPin;
import com.chipsim.hdlgen.model.Wire;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads Digital Logic Sim chip JSON into a {@link ChipGraph}.
 */
public class ChipDocumentParser {
    private static final Logger log = LoggerFactory.getLogger(ChipDocumentParser.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    public ChipGraph parse(Path path) throws IOException {
        String fileName = path.getFileName().toString();
        log.info("Parsing chip document: {}", fileName);
        try {
            return parse(Files.readString(path));
        } catch (ChipDocumentException e) {
            throw new ChipDocumentException(fileName + ": " + e.getMessage(), e);
        }
    }

    public ChipGraph parse(String json) {
        ChipDocument document;
        try {
            document = objectMapper.readValue(json, ChipDocument.class);
        } catch (JsonProcessingException e) {
            throw new ChipDocumentException("Malformed chip JSON: " + e.getOriginalMessage(), e);
        }
        if (document == null) {
            throw new ChipDocumentException("Chip document is empty");
        }
        return toGraph(document);
    }

    ChipGraph toGraph(ChipDocument document) {
        ChipGraph.ChipGraphBuilder graph = ChipGraph.builder()
                .name(document.name() != null ? document.name() : "UnknownChip");

        for (ChipDocument.PinDocument pin : document.inputPins()) {
            graph.inputPin(toPin(pin, "InputPins"));
        }
        for (ChipDocument.PinDocument pin : document.outputPins()) {
            graph.outputPin(toPin(pin, "OutputPins"));
        }
        for (ChipDocument.SubChipDocument subChip : document.subChips()) {
            graph.instance(toInstance(subChip));
        }
        int wireNumber = 0;
        for (ChipDocument.WireDocument wire : document.wires()) {
            graph.wire(toWire(wire, wireNumber++));
        }
        return graph.build();
    }

    private static TopLevelPin toPin(ChipDocument.PinDocument pin, String section) {
        if (pin.id() == null) {
            throw new ChipDocumentException(section + " entry '" + pin.name() + "' has no ID");
        }
        String name = pin.name() != null ? pin.name() : "pin" + pin.id();
        int bitCount = pin.bitCount() != null ? pin.bitCount() : 1;
        if (bitCount < 1) {
            throw new ChipDocumentException(section + " entry '" + name + "' has BitCount " + bitCount);
        }
        return new TopLevelPin(pin.id(), name, bitCount);
    }

    private static ComponentInstance toInstance(ChipDocument.SubChipDocument subChip) {
        if (subChip.id() == null) {
            throw new ChipDocumentException("SubChips entry '" + subChip.name() + "' has no ID");
        }
        ComponentInstance.ComponentInstanceBuilder instance = ComponentInstance.builder()
                .id(subChip.id())
                .rawTypeName(subChip.name() != null ? subChip.name() : "")
                .label(subChip.label());
        if (subChip.outputPinColourInfo() != null) {
            for (ChipDocument.OutputPinInfo info : subChip.outputPinColourInfo()) {
                if (info.pinId() != null) {
                    instance.declaredOutput(info.pinId());
                }
            }
        }
        return instance.build();
    }

    private static Wire toWire(ChipDocument.WireDocument wire, int wireNumber) {
        return new Wire(
                toAddress(wire.source(), "SourcePinAddress", wireNumber),
                toAddress(wire.target(), "TargetPinAddress", wireNumber));
    }

    private static PinAddress toAddress(ChipDocument.PinAddressDocument address, String field, int wireNumber) {
        if (address == null || address.ownerId() == null || address.pinId() == null) {
            throw new ChipDocumentException("Wires[" + wireNumber + "]." + field + " is incomplete");
        }
        return new PinAddress(address.ownerId(), address.pinId());
    }
}
