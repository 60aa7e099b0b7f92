package com.farmerworking.filters.in.java.api.impl;

import com.farmerworking.filters.in.java.api.Options;
import com.google.gson.Gson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LogImpl implements Options.Logger {
    private final Gson gson;
    private final Logger logger;

    public LogImpl(String name) {
        this.logger = LoggerFactory.getLogger(name);
        this.gson = new Gson();
    }

    @Override
    public void log(String msg, String... args) {
        if (args != null && args.length > 0) {
            this.logger.info(String.format("%s, args: %s", msg, gson.toJson(args)));
        } else {
            this.logger.info(msg);
        }
    }
}
