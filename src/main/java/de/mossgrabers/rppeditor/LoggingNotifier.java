// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.MissingResourceException;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;


/**
 * Resolves the message IDs from the string resources and writes the messages to a logger.
 *
 * @author Jürgen Moßgraber
 */
public class LoggingNotifier implements INotifier
{
    private static final String         BUNDLE_NAME = "de.mossgrabers.rppeditor.Strings";
    private static final ResourceBundle STRINGS     = ResourceBundle.getBundle (BUNDLE_NAME);

    private final Logger                logger;


    /**
     * Constructor. Logs to the logger of the editor package.
     */
    public LoggingNotifier ()
    {
        this (Logger.getLogger (LoggingNotifier.class.getPackageName ()));
    }


    /**
     * Constructor.
     *
     * @param logger Where to log to
     */
    public LoggingNotifier (final Logger logger)
    {
        this.logger = logger;
    }


    /** {@inheritDoc} */
    @Override
    public void log (final String messageID, final String... replaceStrings)
    {
        this.logger.info (getMessage (messageID, replaceStrings));
    }


    /** {@inheritDoc} */
    @Override
    public void logError (final String messageID, final String... replaceStrings)
    {
        this.logger.severe (getMessage (messageID, replaceStrings));
    }


    /** {@inheritDoc} */
    @Override
    public void logError (final String messageID, final Throwable throwable)
    {
        this.logger.log (Level.SEVERE, getMessage (messageID, getMessage (throwable)), throwable);
    }


    /** {@inheritDoc} */
    @Override
    public void logError (final Throwable throwable)
    {
        final StringWriter sw = new StringWriter ();
        final PrintWriter pw = new PrintWriter (sw);
        throwable.printStackTrace (pw);
        this.logger.severe (getMessage (throwable) + '\n' + sw);
    }


    /**
     * Get a message from the string resources. If there is no message for the ID, the ID itself
     * is used.
     *
     * @param messageID The ID of the message
     * @param replaceStrings Replaces the %1..%n in the message with the strings
     * @return The message
     */
    public static String getMessage (final String messageID, final String... replaceStrings)
    {
        String message;
        try
        {
            message = STRINGS.getString (messageID);
        }
        catch (final MissingResourceException ex)
        {
            message = messageID;
        }

        // Replace from the back, otherwise %1 would match %10
        for (int i = replaceStrings.length; i > 0; i--)
            message = message.replace ("%" + i, replaceStrings[i - 1] == null ? "" : replaceStrings[i - 1]);
        return message;
    }


    private static String getMessage (final Throwable throwable)
    {
        final String message = throwable.getMessage ();
        return message == null ? throwable.getClass ().getName () : message;
    }
}
