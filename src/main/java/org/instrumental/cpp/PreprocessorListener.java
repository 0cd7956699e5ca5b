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

import javax.annotation.Nonnull;

/**
 * A handler for preprocessor events, primarily errors and warnings.
 *
 * If no PreprocessorListener is installed in a Preprocessor, all
 * errors will cause an exception to be thrown, and warnings are
 * logged.
 *
 * All callbacks are made synchronously on the thread running the
 * preprocessor.
 */
public interface PreprocessorListener {

    /**
     * Handles a warning.
     *
     * The behaviour of this method is defined by the
     * implementation. It may simply record the error message, or
     * it may throw an exception.
     */
    public void handleWarning(int line, int column, @Nonnull String msg)
            throws LexerException;

    /**
     * Handles an error.
     *
     * The behaviour of this method is defined by the
     * implementation. It may simply record the error message, or
     * it may throw an exception.
     */
    public void handleError(int line, int column, @Nonnull String msg)
            throws LexerException;

    /**
     * Reports progress after each logical line.
     *
     * {@code processed} never decreases during one run and never
     * exceeds {@code total}.
     */
    public void handleProgress(int processed, int total);
}
