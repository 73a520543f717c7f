// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor.core;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Locale;
import java.util.Properties;


/**
 * The settings of the editor. The defaults are read from the class-path, a properties file of
 * the user can overwrite them.
 *
 * @author Jürgen Moßgraber
 */
public class EditorConfig
{
    /** The name of the template used to create new projects. */
    public static final String  PROJECT_TEMPLATE    = "project.template";
    /** The sample rate of new projects. */
    public static final String  PROJECT_SAMPLE_RATE = "project.samplerate";
    /** The tempo of new projects. */
    public static final String  PROJECT_TEMPO       = "project.tempo";
    /** The line separator of new projects: CRLF or LF. */
    public static final String  PROJECT_LINE_ENDING = "project.lineending";
    /** Should new items loop their source? */
    public static final String  ITEM_LOOP           = "item.loop";

    private static final String DEFAULTS_RESOURCE   = "editor.properties";

    private final Properties    properties          = new Properties ();


    /**
     * Constructor. Loads the default settings.
     *
     * @throws IOException Could not read the default settings
     */
    public EditorConfig () throws IOException
    {
        try (final InputStream in = EditorConfig.class.getResourceAsStream (DEFAULTS_RESOURCE))
        {
            if (in == null)
                throw new FileNotFoundException ("Default settings not found: " + DEFAULTS_RESOURCE);
            this.properties.load (in);
        }
    }


    /**
     * Loads the default settings and overwrites them with the settings from the given file.
     *
     * @param userSettings The properties file of the user, ignored if it does not exist
     * @return The settings
     * @throws IOException Could not read the settings
     */
    public static EditorConfig load (final File userSettings) throws IOException
    {
        final EditorConfig config = new EditorConfig ();
        if (userSettings.exists ())
        {
            try (final Reader reader = Files.newBufferedReader (userSettings.toPath (), StandardCharsets.UTF_8))
            {
                config.properties.load (reader);
            }
        }
        return config;
    }


    /**
     * Get a setting.
     *
     * @param key The key of the setting
     * @return The value or null if not set
     */
    public String getProperty (final String key)
    {
        return this.properties.getProperty (key);
    }


    /**
     * Change a setting.
     *
     * @param key The key of the setting
     * @param value The new value
     */
    public void setProperty (final String key, final String value)
    {
        this.properties.setProperty (key, value);
    }


    /**
     * Get the name of the template for new projects.
     *
     * @return The template name
     */
    public String getTemplateName ()
    {
        return this.properties.getProperty (PROJECT_TEMPLATE, "minimal");
    }


    /**
     * Get the sample rate for new projects.
     *
     * @return The sample rate
     * @throws IllegalStateException The setting is not an integer
     */
    public int getSampleRate ()
    {
        final String value = this.properties.getProperty (PROJECT_SAMPLE_RATE, "44100").trim ();
        try
        {
            return Integer.parseInt (value);
        }
        catch (final NumberFormatException ex)
        {
            throw new IllegalStateException ("Setting '" + PROJECT_SAMPLE_RATE + "' is not an integer: " + value, ex);
        }
    }


    /**
     * Get the tempo for new projects.
     *
     * @return The tempo in beats per minute
     * @throws IllegalStateException The setting is not a number
     */
    public double getTempo ()
    {
        final String value = this.properties.getProperty (PROJECT_TEMPO, "120").trim ();
        try
        {
            return Double.parseDouble (value);
        }
        catch (final NumberFormatException ex)
        {
            throw new IllegalStateException ("Setting '" + PROJECT_TEMPO + "' is not a number: " + value, ex);
        }
    }


    /**
     * Get the line separator for new projects.
     *
     * @return The line separator
     */
    public String getLineSeparator ()
    {
        final String value = this.properties.getProperty (PROJECT_LINE_ENDING, "CRLF").trim ().toUpperCase (Locale.US);
        return "LF".equals (value) ? "\n" : "\r\n";
    }


    /**
     * Should new items loop their source?
     *
     * @return True to loop
     */
    public boolean isItemLoop ()
    {
        return Boolean.parseBoolean (this.properties.getProperty (ITEM_LOOP, "true").trim ());
    }
}
