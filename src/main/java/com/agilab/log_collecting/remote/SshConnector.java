package com.agilab.log_collecting.remote;

import com.agilab.log_collecting.model.SessionConfig;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;

/**
 * Opens an authenticated SSH transport. The returned session is connected.
 */
@FunctionalInterface
public interface SshConnector {

    Session open(SessionConfig config) throws JSchException;
}
