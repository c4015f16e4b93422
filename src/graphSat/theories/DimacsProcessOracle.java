/*
 * Copyright (c) 2015 Ondrej Kuzelka
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy of this software and associated documentation files (the "Software"), to deal in the Software without restriction, including without limitation the rights to use, copy, modify, merge, publish, distribute, sublicense, and/or sell copies of the Software, and to permit persons to whom the Software is furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.
 */

package graphSat.theories;

import graphSat.encoding.CnfFormula;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external MiniSat-compatible executable. The formula goes to a temporary DIMACS file, the command is invoked
 * as {@code command... input output} and the result file is read back with {@link Dimacs#parseResult(List)}. The
 * solver process never outlives the call.
 */
public class DimacsProcessOracle implements SatOracle {

    private static final Logger log = LogManager.getFormatterLogger();

    private final List<String> command;

    // seconds, 0 means no limit
    private int timeout = 0;

    public DimacsProcessOracle(String... command){
        this(Arrays.asList(command));
    }

    public DimacsProcessOracle(List<String> command){
        if (command.isEmpty()){
            throw new IllegalArgumentException("Empty solver command");
        }
        this.command = new ArrayList<String>(command);
    }

    @Override
    public Outcome solve(CnfFormula formula) throws OracleException {
        Path input = null;
        Path output = null;
        Path console = null;
        Process process = null;
        try {
            input = Files.createTempFile("graphsat", ".cnf");
            output = Files.createTempFile("graphsat", ".out");
            console = Files.createTempFile("graphsat", ".log");
            Writer writer = Files.newBufferedWriter(input, StandardCharsets.US_ASCII);
            try {
                Dimacs.write(formula, writer);
            } finally {
                writer.close();
            }
            List<String> invocation = new ArrayList<String>(this.command);
            invocation.add(input.toString());
            invocation.add(output.toString());
            log.debug("running %s", invocation);
            process = new ProcessBuilder(invocation)
                    .redirectErrorStream(true)
                    .redirectOutput(console.toFile())
                    .start();
            int exitCode;
            if (this.timeout > 0){
                if (!process.waitFor(this.timeout, TimeUnit.SECONDS)){
                    throw new OracleException(this.command.get(0) + " did not finish within " + this.timeout + "s");
                }
                exitCode = process.exitValue();
            } else {
                exitCode = process.waitFor();
            }
            List<String> lines = Files.readAllLines(output, StandardCharsets.US_ASCII);
            if (lines.isEmpty()){
                throw new OracleException(this.command.get(0) + " exited with code " + exitCode + " and wrote no result");
            }
            return Dimacs.parseResult(lines);
        } catch (IOException e){
            throw new OracleException("Could not run " + this.command.get(0) + ": " + e.getMessage(), e);
        } catch (InterruptedException e){
            Thread.currentThread().interrupt();
            throw new OracleException("Interrupted while waiting for " + this.command.get(0), e);
        } finally {
            if (process != null && process.isAlive()){
                process.destroyForcibly();
            }
            deleteQuietly(input);
            deleteQuietly(output);
            deleteQuietly(console);
        }
    }

    private static void deleteQuietly(Path path){
        if (path == null){
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e){
            log.warn("could not delete temporary file %s: %s", path, e.getMessage());
        }
    }

    public List<String> command(){
        return Collections.unmodifiableList(this.command);
    }

    public int getTimeout() {
        return timeout;
    }

    public void setTimeout(int timeout) {
        if (timeout < 0){
            throw new IllegalArgumentException("timeout must be non-negative, got " + timeout);
        }
        this.timeout = timeout;
    }
}
