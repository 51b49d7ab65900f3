package com.fhi.libraries.app_unittest.provision;

import java.util.List;

import lombok.extern.slf4j.Slf4j;

@Slf4j
final class DisposerChain
{
    private DisposerChain()
    {
    }

    static void disposeAll(List<Disposer> steps)
    {
        RuntimeException first = null;
        for (Disposer step : steps)
        {   try
            {   step.dispose();
            }
            catch (RuntimeException e)
            {   if (first == null)
                {   first = e;
                }
                else
                {   log.warn("Further disposal failure, attached as suppressed: {}", e.toString());
                    first.addSuppressed(e);
                }
            }
        }
        if (first != null) throw first;
    }
}
