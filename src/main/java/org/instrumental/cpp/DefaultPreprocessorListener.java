/*
 * Anarres C Preprocessor
 * Copyright (c) 2007-2015, Shevek
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.instrumental.cpp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A handler for preprocessor events, primarily errors and warnings.
 *
 * Warnings are logged and collected. Errors are thrown as
 * {@link ParseException ParseExceptions}, since a structurally broken
 * header has no meaningful output.
 */
public class DefaultPreprocessorListener implements PreprocessorListener {

    private static final Logger LOG = LoggerFactory.getLogger(DefaultPreprocessorListener.class);

    private final List<String> warnings = new ArrayList<String>();
    private int errors;

    public void clear() {
        warnings.clear();
        errors = 0;
    }

    @Nonnegative
    public int getErrors() {
        return errors;
    }

    @Nonnull
    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    @Override
    public void handleWarning(int line, int column, @Nonnull String msg)
            throws LexerException {
        warnings.add(msg);
        LOG.warn(line + ":" + column + ": warning: " + msg);
    }

    @Override
    public void handleError(int line, int column, @Nonnull String msg)
            throws LexerException {
        errors++;
        throw new ParseException(line, column, msg);
    }

    @Override
    public void handleProgress(int processed, int total) {
        if (LOG.isTraceEnabled())
            LOG.trace("Processed " + processed + " of " + total + " lines");
    }
}
