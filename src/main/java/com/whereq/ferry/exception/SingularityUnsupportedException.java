package com.whereq.ferry.exception;

/**
 * The job needs Singularity, which requires privileges the pipeline containers do not get
 */
public class SingularityUnsupportedException extends FerryException {
    public SingularityUnsupportedException(String jobName) {
        super("Job " + jobName + " requires Singularity, which needs additional capabilities that "
            + "aren't supported for standard Docker runs on Google Life Sciences.");
    }
}
