package com.crossreview.core.prompt;

import com.crossreview.core.model.ContentFingerprint;
import com.crossreview.core.model.FileIdentity;

/**
 * Everything a prompt needs to know about one changed file, fetched once per stage.
 * The fingerprint is computed from exactly the {@code diff} shown to the model, so cache writes
 * always describe what was reviewed.
 *
 * @param path        normalized project-relative path
 * @param identity    file identity
 * @param fingerprint fingerprint of {@code diff}
 * @param diff        pending diff against HEAD
 * @param content     full current content (empty for classification and low-risk prompts)
 * @param imports     import lines of the file (empty when not needed)
 */
public record FileContext(
    String path,
    FileIdentity identity,
    ContentFingerprint fingerprint,
    String diff,
    String content,
    String imports
) {

    public FileContext {
        diff = diff == null ? "" : diff;
        content = content == null ? "" : content;
        imports = imports == null ? "" : imports;
    }
}
