package it.unimore.iot.labelingline.util.senml;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

// Singolo record SenML (RFC 8428); i campi nulli non vengono serializzati
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SenMLRecord {

    @JsonProperty("bn")
    private String baseName;

    @JsonProperty("n")
    private String name;

    @JsonProperty("u")
    private String unit;

    @JsonProperty("v")
    private Double value;

    @JsonProperty("vs")
    private String stringValue;

    @JsonProperty("vb")
    private Boolean booleanValue;

    @JsonProperty("t")
    private Long time;

    public SenMLRecord() {
    }

    public static SenMLRecord numeric(String name, double value, String unit) {
        SenMLRecord record = new SenMLRecord();
        record.setName(name);
        record.setValue(value);
        record.setUnit(unit);
        return record;
    }

    public static SenMLRecord text(String name, String value) {
        SenMLRecord record = new SenMLRecord();
        record.setName(name);
        record.setStringValue(value);
        return record;
    }

    public static SenMLRecord bool(String name, boolean value) {
        SenMLRecord record = new SenMLRecord();
        record.setName(name);
        record.setBooleanValue(value);
        return record;
    }

    public String getBaseName() {
        return baseName;
    }

    public void setBaseName(String baseName) {
        this.baseName = baseName;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getUnit() {
        return unit;
    }

    public void setUnit(String unit) {
        this.unit = unit;
    }

    public Double getValue() {
        return value;
    }

    public void setValue(Double value) {
        this.value = value;
    }

    public String getStringValue() {
        return stringValue;
    }

    public void setStringValue(String stringValue) {
        this.stringValue = stringValue;
    }

    public Boolean getBooleanValue() {
        return booleanValue;
    }

    public void setBooleanValue(Boolean booleanValue) {
        this.booleanValue = booleanValue;
    }

    public Long getTime() {
        return time;
    }

    public void setTime(Long time) {
        this.time = time;
    }
}
