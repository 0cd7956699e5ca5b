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

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * One level of conditional compilation.
 *
 * {@code active} is whether the current branch of this level is live,
 * {@code taken} whether any branch of this level has been live so far.
 * A branch only emits output if every enclosing level is active, which
 * is cached in {@code parent}.
 */
/* pp */ class State {

    private final boolean parent;
    private final boolean active;
    private final boolean taken;
    private final boolean sawElse;
    /* The #if, #ifdef or #ifndef which opened this level. */
    @CheckForNull
    private final Token opener;

    /* pp */ State() {
        this(true, true, true, false, null);
    }

    private State(boolean parent, boolean active, boolean taken, boolean sawElse, @CheckForNull Token opener) {
        this.parent = parent;
        this.active = active;
        this.taken = taken;
        this.sawElse = sawElse;
        this.opener = opener;
    }

    /**
     * Opens a nested level below the given one.
     *
     * Inside an inactive level the new level can never become active,
     * so it is marked as already taken.
     */
    /* pp */ State(@Nonnull State parent, @Nonnull Token opener, boolean condition) {
        this.parent = parent.isParentActive() && parent.isActive();
        this.active = this.parent && condition;
        this.taken = !this.parent || condition;
        this.sawElse = false;
        this.opener = opener;
    }

    /* pp */ boolean isParentActive() {
        return parent;
    }

    /* pp */ boolean isActive() {
        return active;
    }

    /* pp */ boolean isTaken() {
        return taken;
    }

    @CheckForNull
    /* pp */ Token getOpener() {
        return opener;
    }

    /* pp */ boolean sawElse() {
        return sawElse;
    }

    /**
     * Applies an #elif whose condition evaluated to the given value.
     * The first live branch wins.
     */
    /* pp */ State withElif(boolean condition) {
        boolean live = !taken && condition;
        return new State(parent, live, taken || condition, false, opener);
    }

    /* pp */ State withElse() {
        return new State(parent, !taken, true, true, opener);
    }

    @Override
    public String toString() {
        return "parent=" + parent
                + ", active=" + active
                + ", taken=" + taken
                + ", sawelse=" + sawElse;
    }
}
