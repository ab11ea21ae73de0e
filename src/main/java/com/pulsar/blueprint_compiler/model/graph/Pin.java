package com.pulsar.blueprint_compiler.model.graph;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Pin {
    private String name;
    private PinDirection direction;
    private PinType type = PinType.wildcard();

    // Literal used when nothing is wired in: String, Number, Boolean or a List of those
    private Object defaultValue;

    public static Pin input(String name, PinType type) {
        return new Pin(name, PinDirection.INPUT, type, null);
    }

    public static Pin output(String name, PinType type) {
        return new Pin(name, PinDirection.OUTPUT, type, null);
    }

    public Pin withDefault(Object value) {
        this.defaultValue = value;
        return this;
    }

    @JsonIgnore
    public boolean isExecution() {
        return type != null && type.isExecution();
    }

    public Pin copy() {
        return new Pin(name, direction, type, defaultValue);
    }
}
