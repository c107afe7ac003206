package com.beyond.webdav.util;

import org.apache.commons.io.DirectoryWalker;
import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

public class FileUtil {

    /**
     * Lists the regular files under {@code root}, top-down: the files of a directory come first (by name), then
     * each subdirectory is descended into (by name). Symbolic links to directories are not followed.
     */
    public static List<File> listFilesTopDown(File root) throws IOException {
        if (!root.isDirectory()) {
            throw new FileNotFoundException("not a directory: " + root.getPath());
        }
        List<File> result = new ArrayList<>();
        new TopDownWalker().collect(root, result);
        return result;
    }

    private static class TopDownWalker extends DirectoryWalker<File> {

        private static final Comparator<File> FILES_FIRST = Comparator
                .comparing(File::isDirectory)
                .thenComparing(File::getName);

        void collect(File root, Collection<File> result) throws IOException {
            walk(root, result);
        }

        @Override
        protected boolean handleDirectory(File directory, int depth, Collection<File> results) throws IOException {
            return depth == 0 || !FileUtils.isSymlink(directory);
        }

        @Override
        protected File[] filterDirectoryContents(File directory, int depth, File... files) {
            if (files == null) {
                return null;
            }
            File[] sorted = Arrays.copyOf(files, files.length);
            Arrays.sort(sorted, FILES_FIRST);
            return sorted;
        }

        @Override
        protected void handleFile(File file, int depth, Collection<File> results) {
            if (file.isFile()) {
                results.add(file);
            }
        }
    }

}
