package com.baskettecase.dbmcp.service;

import com.baskettecase.dbmcp.db.ConnectionProfile;
import lombok.Value;

/**
 * Where a logical database points, without the password.
 */
@Value
public class ConnectionSummary {
    String host;
    int port;
    String database;
    String user;

    public static ConnectionSummary of(ConnectionProfile profile) {
        return new ConnectionSummary(profile.getHost(), profile.getPort(), profile.getDatabaseName(), profile.getUser());
    }
}
