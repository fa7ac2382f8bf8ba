package com.skillq.subject;

public enum EquipmentType {
    COMPACTOR,
    DUMPSTER,
    MIXED
}
