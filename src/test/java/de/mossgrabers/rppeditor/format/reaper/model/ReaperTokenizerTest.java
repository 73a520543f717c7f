// Written by Jürgen Moßgraber - mossgrabers.de
// (c) 2021-2024
// Licensed under LGPLv3 - http://www.gnu.org/licenses/lgpl-3.0.txt

package de.mossgrabers.rppeditor.format.reaper.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import de.mossgrabers.rppeditor.core.LexException;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;


class ReaperTokenizerTest
{
    @Test
    void classifiesLines () throws LexException
    {
        final List<Token> tokens = tokenize ("<REAPER_PROJECT 0.1 \"7.0\" 1\n  TEMPO 120 4 4\n\n  # note\n>\n");

        assertThat (tokens).extracting (Token::getType).containsExactly (TokenType.BLOCK_OPEN, TokenType.DIRECTIVE, TokenType.COMMENT, TokenType.COMMENT, TokenType.BLOCK_CLOSE);
        assertThat (tokens.get (0).getTag ()).isEqualTo ("REAPER_PROJECT");
        assertThat (tokens.get (0).getParameters ()).extracting (Parameter::getType).containsExactly (ParameterType.DECIMAL, ParameterType.STRING, ParameterType.INTEGER);
        assertThat (tokens.get (1).getIndent ()).isEqualTo ("  ");
        assertThat (tokens.get (1).getLineNumber ()).isEqualTo (2);
    }


    @Test
    void splitsQuotedParameters () throws LexException
    {
        final Token token = ReaperTokenizer.tokenizeLine ("<VST \"VSTi: ReaSynth (Cockos)\" reasynth.so 0 \"\" 'it\"s' `a 'b'` \\\"", 1);

        assertThat (token.getParameters ()).extracting (Parameter::getValue).containsExactly ("VSTi: ReaSynth (Cockos)", "reasynth.so", "0", "", "it\"s", "a 'b'", "\\\"");
        assertThat (token.getParameters ().get (0).getText ()).isEqualTo ("\"VSTi: ReaSynth (Cockos)\"");
    }


    @Test
    void quoteInsideAWordDoesNotStartAString () throws LexException
    {
        final Token token = ReaperTokenizer.tokenizeLine ("FILE C:\\It's\\here.mid", 1);
        assertThat (token.getParameters ()).extracting (Parameter::getValue).containsExactly ("C:\\It's\\here.mid");
    }


    @Test
    void escapedQuoteIsPartOfTheString () throws LexException
    {
        final Token token = ReaperTokenizer.tokenizeLine ("NAME \"say \\\"hi\\\"!\"", 1);
        assertThat (token.getParameters ().get (0).getValue ()).isEqualTo ("say \"hi\"!");
    }


    @Test
    void textLinesAreKeptWhole () throws LexException
    {
        final Token token = ReaperTokenizer.tokenizeLine ("    |don't \"stop", 7);
        assertThat (token.getType ()).isEqualTo (TokenType.DIRECTIVE);
        assertThat (token.getTag ()).isEqualTo ("|don't \"stop");
        assertThat (token.getParameters ()).isEmpty ();
    }


    @Test
    void pluginStateIsABareword () throws LexException
    {
        final Token token = ReaperTokenizer.tokenizeLine ("      eXNlcu5e7f4AAAAAAgAAAA==", 3);
        assertThat (token.getType ()).isEqualTo (TokenType.DIRECTIVE);
        assertThat (token.getTag ()).isEqualTo ("eXNlcu5e7f4AAAAAAgAAAA==");
    }


    @Test
    void unterminatedQuoteFails ()
    {
        assertThatThrownBy ( () -> ReaperTokenizer.tokenizeLine ("  NAME \"Drums", 4)).isInstanceOf (LexException.class).hasMessageContaining ("Unterminated").hasMessageContaining ("line 4");
    }


    @Test
    void chunkWithoutNameFails ()
    {
        assertThatThrownBy ( () -> ReaperTokenizer.tokenizeLine ("  <", 2)).isInstanceOf (LexException.class).hasMessageContaining ("without a name");
    }


    @Test
    void detectsTheLineSeparator () throws LexException
    {
        final ReaperTokenizer crlf = new ReaperTokenizer ("<A\r\n>\r\n");
        crlf.next ();
        assertThat (crlf.getLineSeparator ()).isEqualTo (ReaperTokenizer.CRLF);
        final Token close = crlf.next ();
        assertThat (close.getLine ()).isEqualTo (">");
        assertThat (close.getLineEnding ()).isEqualTo (ReaperTokenizer.CRLF);
        assertThat (crlf.endsWithLineSeparator ()).isTrue ();

        final ReaperTokenizer lf = new ReaperTokenizer ("<A\n>");
        assertThat (lf.next ().getLineEnding ()).isEqualTo (ReaperTokenizer.LF);
        assertThat (lf.next ().getLineEnding ()).isEmpty ();
        assertThat (lf.getLineSeparator ()).isEqualTo (ReaperTokenizer.LF);
        assertThat (lf.endsWithLineSeparator ()).isFalse ();
        assertThatThrownBy (lf::next).isInstanceOf (NoSuchElementException.class);
    }


    @Test
    void keepsTheEndingOfEachLine () throws LexException
    {
        final List<Token> tokens = tokenize ("<A\r\n  B 1\n>\r\n");
        assertThat (tokens).extracting (Token::getLineEnding).containsExactly ("\r\n", "\n", "\r\n");
    }


    @Test
    void byteOrderMarkIsNotPartOfTheFirstLine () throws LexException
    {
        final ReaperTokenizer tokenizer = new ReaperTokenizer ("\uFEFF<REAPER_PROJECT 0.1\n>");
        assertThat (tokenizer.hasByteOrderMark ()).isTrue ();

        final Token token = tokenizer.next ();
        assertThat (token.getType ()).isEqualTo (TokenType.BLOCK_OPEN);
        assertThat (token.getTag ()).isEqualTo ("REAPER_PROJECT");
        assertThat (token.getIndent ()).isEmpty ();
        assertThat (token.getLine ()).isEqualTo ("<REAPER_PROJECT 0.1");

        assertThat (new ReaperTokenizer ("<A\n>").hasByteOrderMark ()).isFalse ();
    }


    private static List<Token> tokenize (final String text) throws LexException
    {
        final ReaperTokenizer tokenizer = new ReaperTokenizer (text);
        final List<Token> tokens = new ArrayList<> ();
        while (tokenizer.hasNext ())
            tokens.add (tokenizer.next ());
        return tokens;
    }
}
