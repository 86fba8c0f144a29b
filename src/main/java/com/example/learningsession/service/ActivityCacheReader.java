package com.example.learningsession.service;

import com.example.learningsession.kv.KvClient;
import com.example.learningsession.model.CourseActivitySnapshot;
import com.example.learningsession.model.VideoActivitySnapshot;
import lombok.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

import static com.example.learningsession.service.CacheSnapshotCodec.courseKey;
import static com.example.learningsession.service.CacheSnapshotCodec.videoKey;

/**
 * Reads a video cache and its course cache together, so callers never compare
 * values taken at different moments.
 */
@Service
public class ActivityCacheReader {

    private final KvClient kvClient;
    private final CacheSnapshotCodec codec;

    public ActivityCacheReader(KvClient kvClient, CacheSnapshotCodec codec) {
        this.kvClient = kvClient;
        this.codec = codec;
    }

    public ActivityCacheView read(String videoId, String courseId) {
        String vKey = videoKey(videoId);
        String cKey = courseKey(courseId);
        Map<String, String> values = kvClient.mget(List.of(vKey, cKey));
        return new ActivityCacheView(
                codec.readVideo(values.get(vKey)).orElseGet(() -> VideoActivitySnapshot.empty(videoId, courseId)),
                codec.readCourse(values.get(cKey)).orElseGet(() -> CourseActivitySnapshot.empty(courseId)));
    }

    public CourseActivitySnapshot readCourse(String courseId) {
        return kvClient.get(courseKey(courseId))
                .flatMap(codec::readCourse)
                .orElseGet(() -> CourseActivitySnapshot.empty(courseId));
    }

    @Value
    public static class ActivityCacheView {
        VideoActivitySnapshot video;
        CourseActivitySnapshot course;

        public boolean isConsistent() {
            Integer counted = course.getVideoCounts().get(video.getVideoId());
            return counted == null ? video.getActivityCount() == 0 : counted == video.getActivityCount();
        }
    }
}
