package com.agilab.log_collecting.remote;

import com.agilab.log_collecting.model.CommandResult;

import java.time.Duration;

@FunctionalInterface
public interface RemoteCommandExecutor {

    CommandResult executeCommand(String command, Duration timeout);
}
