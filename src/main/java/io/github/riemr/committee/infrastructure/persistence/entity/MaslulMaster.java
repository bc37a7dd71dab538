package io.github.riemr.committee.infrastructure.persistence.entity;

import java.io.Serializable;

public class MaslulMaster implements Serializable {
    private Long maslulId;
    private Long hativaId;
    private String name;
    private Boolean active;
    private Integer slaDays;
    private Integer stageADays;
    private Integer stageBDays;
    private Integer stageCDays;
    private Integer stageDDays;

    public Long getMaslulId() { return maslulId; }
    public void setMaslulId(Long maslulId) { this.maslulId = maslulId; }
    public Long getHativaId() { return hativaId; }
    public void setHativaId(Long hativaId) { this.hativaId = hativaId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public Boolean getActive() { return active; }
    public void setActive(Boolean active) { this.active = active; }
    public Integer getSlaDays() { return slaDays; }
    public void setSlaDays(Integer slaDays) { this.slaDays = slaDays; }
    public Integer getStageADays() { return stageADays; }
    public void setStageADays(Integer stageADays) { this.stageADays = stageADays; }
    public Integer getStageBDays() { return stageBDays; }
    public void setStageBDays(Integer stageBDays) { this.stageBDays = stageBDays; }
    public Integer getStageCDays() { return stageCDays; }
    public void setStageCDays(Integer stageCDays) { this.stageCDays = stageCDays; }
    public Integer getStageDDays() { return stageDDays; }
    public void setStageDDays(Integer stageDDays) { this.stageDDays = stageDDays; }
}
