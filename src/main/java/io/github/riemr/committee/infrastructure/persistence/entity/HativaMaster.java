package io.github.riemr.committee.infrastructure.persistence.entity;

import java.io.Serializable;

public class HativaMaster implements Serializable {
    private Long hativaId;
    private String name;
    private String color;
    private Boolean active;

    public Long getHativaId() { return hativaId; }
    public void setHativaId(Long hativaId) { this.hativaId = hativaId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getColor() { return color; }
    public void setColor(String color) { this.color = color; }
    public Boolean getActive() { return active; }
    public void setActive(Boolean active) { this.active = active; }
}
