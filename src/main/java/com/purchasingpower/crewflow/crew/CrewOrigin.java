package com.purchasingpower.crewflow.crew;

public enum CrewOrigin {
    CODE,
    DATABASE
}
