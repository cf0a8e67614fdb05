package com.gpufleet.governor.model;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class CommandResult {
    public static final int NO_EXIT_CODE = -1;

    private int exitCode;
    private String output;
    private String error;

    public static CommandResult failure(String reason) {
        return new CommandResult(NO_EXIT_CODE, "", reason);
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
