package org.carball.tuner.model.run;

public enum RunState {
    IDLE,
    RUNNING
}
