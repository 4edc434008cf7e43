package com.pgfga.reconciler.session;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Properties;

@FunctionalInterface
public interface ConnectionOpener {

    Connection open(String url, Properties properties) throws SQLException;
}
