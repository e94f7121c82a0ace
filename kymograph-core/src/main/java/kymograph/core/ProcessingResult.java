package kymograph.core;

import kymograph.io.KymographImage;
import kymograph.utils.MultipleException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a batch: created kymographs, summary message, and errors localized by image
 */
public class ProcessingResult {
    final List<KymographImage> kymographs;
    final String message;
    final List<String> infos;
    final MultipleException errors;

    public ProcessingResult(List<KymographImage> kymographs, String message, List<String> infos, MultipleException errors) {
        this.kymographs = Collections.unmodifiableList(new ArrayList<>(kymographs));
        this.message = message;
        this.infos = Collections.unmodifiableList(new ArrayList<>(infos));
        this.errors = errors;
    }

    public List<KymographImage> getKymographs() {
        return kymographs;
    }

    public String getMessage() {
        return message;
    }

    /**
     * @return reasons why images or ROIs were skipped
     */
    public List<String> getInfos() {
        return infos;
    }

    public MultipleException getErrors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
