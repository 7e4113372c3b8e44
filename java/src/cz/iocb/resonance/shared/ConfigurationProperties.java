/*
 * Copyright (C) 2015-2017 Jakub Galgonek   galgonek@uochb.cas.cz
 *
 * This program is free software; you can redistribute it and/or modify it under the terms of the GNU Lesser General
 * Public License as published by the Free Software Foundation; either version 2.1 of the License, or (at your option)
 * any later version. All we ask is that proper credit is given for our work, which includes - but is not limited to -
 * adding the above copyright notice to the beginning of your source code files, and to any copyright notice that you
 * may distribute with programs based on this work.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Lesser General Public License for more
 * details.
 */
package cz.iocb.resonance.shared;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;



/**
 * Typed access to the settings of the resonance generator.
 */
public class ConfigurationProperties
{
    public static final String DEFAULT_RESOURCE = "resonance.properties";

    private final Properties properties;


    public ConfigurationProperties(String fileName) throws IOException
    {
        properties = new Properties();

        try(InputStream input = new FileInputStream(fileName))
        {
            properties.load(input);
        }
    }


    public ConfigurationProperties(Properties properties)
    {
        this.properties = properties;
    }


    /**
     * Loads the settings bundled on the classpath. A missing resource results in an empty configuration, so that
     * every getter falls back to its default value.
     *
     * @return configuration read from {@link #DEFAULT_RESOURCE}
     * @throws IOException
     */
    public static ConfigurationProperties getDefault() throws IOException
    {
        Properties properties = new Properties();

        try(InputStream input = ConfigurationProperties.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE))
        {
            if(input != null)
                properties.load(input);
        }

        return new ConfigurationProperties(properties);
    }


    public int getIntProperty(String name, int defaultValue)
    {
        String value = properties.getProperty(name);
        return value == null ? defaultValue : Integer.parseInt(value.trim());
    }


    public double getDoubleProperty(String name, double defaultValue)
    {
        String value = properties.getProperty(name);
        return value == null ? defaultValue : Double.parseDouble(value.trim());
    }


    public boolean getBooleanProperty(String name, boolean defaultValue)
    {
        String value = properties.getProperty(name);
        return value == null ? defaultValue : parseBoolean(name, value.trim());
    }


    private static boolean parseBoolean(String name, String value)
    {
        if(value.equals("true"))
            return true;
        else if(value.equals("false"))
            return false;

        throw new IllegalArgumentException("wrong boolean value of configuration property " + name + ": " + value);
    }
}
