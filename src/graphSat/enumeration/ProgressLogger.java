/*
 * Copyright (c) 2015 Ondrej Kuzelka
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy of this software and associated documentation files (the "Software"), to deal in the Software without restriction, including without limitation the rights to use, copy, modify, merge, publish, distribute, sublicense, and/or sell copies of the Software, and to permit persons to whom the Software is furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.
 */

package graphSat.enumeration;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Logs every n-th recorded step at INFO, the others at DEBUG. Times come from the session, so one logger can be
 * registered on an explorer and shared by its sessions.
 */
public class ProgressLogger implements EnumerationListener {

    private static final Logger log = LogManager.getFormatterLogger();

    private final int every;

    public ProgressLogger(){
        this(100);
    }

    public ProgressLogger(int every){
        if (every <= 0){
            throw new IllegalArgumentException("every must be positive, got " + every);
        }
        this.every = every;
    }

    @Override
    public void stepRecorded(EnumerationStep<?> step) {
        int found = step.index() + 1;
        if (found % this.every == 0){
            log.info("%d solutions after %d ms", found, step.elapsedMillis());
        } else {
            log.debug("solution %d: %s", found, step.solution());
        }
    }

    @Override
    public void finished(EnumerationResult<?> result) {
        log.info("%s in %d ms", result, result.elapsedMillis());
    }
}
