package com.example.learningsession.trigger;

import java.util.List;

/**
 * Read-only access to the trigger points authored for a video.
 */
public interface TriggerPointSource {

    /**
     * @throws com.example.learningsession.exception.TriggerConfigurationException
     *         if the stored configuration can not be parsed
     */
    List<TriggerPoint> findByVideoId(String videoId);
}
