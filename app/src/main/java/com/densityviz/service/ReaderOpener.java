package com.densityviz.service;

import com.densityviz.io.FileOpenException;
import com.densityviz.io.SharedFileReader;

import java.nio.file.Path;

/**
 * Opens the reader a worker samples through.
 */
@FunctionalInterface
interface ReaderOpener {

    ReaderOpener SHARED = SharedFileReader::open;

    SharedFileReader open(Path file) throws FileOpenException;
}
